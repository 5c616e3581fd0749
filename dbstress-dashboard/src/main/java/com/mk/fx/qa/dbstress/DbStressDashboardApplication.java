package com.mk.fx.qa.dbstress;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DbStressDashboardApplication {

  public static void main(String[] args) {
    SpringApplication.run(DbStressDashboardApplication.class, args);
  }
}
