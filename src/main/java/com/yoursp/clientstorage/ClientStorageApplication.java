package com.yoursp.clientstorage;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ClientStorageApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClientStorageApplication.class, args);
    }
}
