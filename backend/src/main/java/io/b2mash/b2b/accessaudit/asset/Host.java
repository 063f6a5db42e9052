package io.b2mash.b2b.accessaudit.asset;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;

@Entity
@Table(name = "hosts")
public class Host extends Asset {

  @Column(name = "os", length = 32)
  private String os;

  protected Host() {}

  public Host(String name, String address, String os, String tenantId) {
    super(name, address, tenantId);
    this.os = os;
  }

  public String getOs() {
    return os;
  }
}
