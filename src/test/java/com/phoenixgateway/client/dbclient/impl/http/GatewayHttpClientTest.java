package com.phoenixgateway.client.dbclient.impl.http;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.phoenixgateway.client.common.TransportFailure;
import com.phoenixgateway.client.exception.PhoenixConnectException;
import java.io.IOException;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
public class GatewayHttpClientTest {

  @Mock CloseableHttpClient mockHttpClient;
  @Mock PoolingHttpClientConnectionManager mockConnectionManager;
  @Mock CloseableHttpResponse mockResponse;

  private GatewayHttpClient gatewayHttpClient;

  @BeforeEach
  public void setUp() {
    gatewayHttpClient = new GatewayHttpClient(mockHttpClient, mockConnectionManager);
  }

  @Test
  public void testExecuteReturnsResponse() throws Exception {
    HttpGet request = new HttpGet("http://localhost:8765/json");
    when(mockHttpClient.execute(request)).thenReturn(mockResponse);

    assertSame(mockResponse, gatewayHttpClient.execute(request));
  }

  @Test
  public void testIoFailureBecomesConnectFailure() throws Exception {
    HttpGet request = new HttpGet("http://localhost:8765/json");
    when(mockHttpClient.execute(request)).thenThrow(new IOException("Connection refused"));

    PhoenixConnectException e =
        assertThrows(PhoenixConnectException.class, () -> gatewayHttpClient.execute(request));

    assertEquals(TransportFailure.CONNECT_FAILED, e.getFailure());
    assertTrue(e.getMessage().contains("GET http://localhost:8765/json"));
    assertInstanceOf(IOException.class, e.getCause());
  }

  @Test
  public void testCloseReleasesPool() throws Exception {
    gatewayHttpClient.close();

    verify(mockHttpClient).close();
    verify(mockConnectionManager).shutdown();
  }

  @Test
  public void testPooledClientCanBeClosed() throws Exception {
    GatewayHttpClient client = new GatewayHttpClient(5);

    assertDoesNotThrow(client::close);
  }
}
