package com.phoenixgateway.client.model.avatica;

/** Column metadata decoded from a query server response. */
public class AvaticaColumn {

  private final String name;
  private final String typeName;

  /**
   * @param name resolved column name, may be null when the server sent none
   * @param typeName engine type name, may be null
   */
  public AvaticaColumn(String name, String typeName) {
    this.name = name;
    this.typeName = typeName;
  }

  public String getName() {
    return name;
  }

  public String getTypeName() {
    return typeName;
  }

  @Override
  public String toString() {
    return name + ":" + typeName;
  }
}
