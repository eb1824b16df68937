package com.helpline.crm;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HelplineCrmApplication {
  public static void main(String[] args) {
    SpringApplication.run(HelplineCrmApplication.class, args);
  }
}
