package com.roomdrawapp;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RoomDrawApplication {

    public static void main(String[] args) {
        SpringApplication.run(RoomDrawApplication.class, args);
    }
}
