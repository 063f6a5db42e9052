package io.b2mash.b2b.accessaudit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AccessAuditApplication {

  public static void main(String[] args) {
    SpringApplication.run(AccessAuditApplication.class, args);
  }
}
