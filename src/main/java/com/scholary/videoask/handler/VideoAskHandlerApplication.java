package com.scholary.videoask.handler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VideoAskHandlerApplication {

  public static void main(String[] args) {
    SpringApplication.run(VideoAskHandlerApplication.class, args);
  }
}
