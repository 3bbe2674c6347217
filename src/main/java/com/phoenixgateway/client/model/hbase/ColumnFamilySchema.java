package com.phoenixgateway.client.model.hbase;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** One column family in a table schema document of the HBase REST server. */
@JsonPropertyOrder({
  "name",
  "maxVersions",
  "compression",
  "bloomFilter",
  "inMemory",
  "timeToLive",
  "blockCache",
  "blocksize"
})
public class ColumnFamilySchema {

  @JsonProperty("name")
  private final String name;

  @JsonProperty("maxVersions")
  private int maxVersions = 1;

  @JsonProperty("compression")
  private String compression = "NONE";

  @JsonProperty("bloomFilter")
  private String bloomFilter = "NONE";

  @JsonProperty("inMemory")
  private boolean inMemory = false;

  @JsonProperty("timeToLive")
  private int timeToLive = Integer.MAX_VALUE;

  @JsonProperty("blockCache")
  private boolean blockCache = true;

  @JsonProperty("blocksize")
  private int blocksize = 65536;

  public ColumnFamilySchema(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  public int getMaxVersions() {
    return maxVersions;
  }

  public ColumnFamilySchema setMaxVersions(int maxVersions) {
    this.maxVersions = maxVersions;
    return this;
  }

  public String getCompression() {
    return compression;
  }

  public ColumnFamilySchema setCompression(String compression) {
    this.compression = compression;
    return this;
  }

  public String getBloomFilter() {
    return bloomFilter;
  }

  public boolean isInMemory() {
    return inMemory;
  }

  public int getTimeToLive() {
    return timeToLive;
  }

  public ColumnFamilySchema setTimeToLive(int timeToLive) {
    this.timeToLive = timeToLive;
    return this;
  }

  public boolean isBlockCache() {
    return blockCache;
  }

  public int getBlocksize() {
    return blocksize;
  }
}
