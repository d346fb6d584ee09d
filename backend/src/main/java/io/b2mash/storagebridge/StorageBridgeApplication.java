package io.b2mash.storagebridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StorageBridgeApplication {

  public static void main(String[] args) {
    SpringApplication.run(StorageBridgeApplication.class, args);
  }
}
