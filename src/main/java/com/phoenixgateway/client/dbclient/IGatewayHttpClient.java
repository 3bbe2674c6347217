package com.phoenixgateway.client.dbclient;

import com.phoenixgateway.client.exception.PhoenixConnectException;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpUriRequest;

/** Http client interface for executing http requests. */
public interface IGatewayHttpClient {

  /**
   * Executes the given http request and returns the response
   *
   * @param request underlying http request
   * @return http response, to be closed by the caller
   * @throws PhoenixConnectException if no response could be obtained
   */
  CloseableHttpResponse execute(HttpUriRequest request) throws PhoenixConnectException;
}
