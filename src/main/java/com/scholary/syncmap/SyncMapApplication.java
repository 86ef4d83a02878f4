package com.scholary.syncmap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SyncMapApplication {

  public static void main(String[] args) {
    SpringApplication.run(SyncMapApplication.class, args);
  }
}
