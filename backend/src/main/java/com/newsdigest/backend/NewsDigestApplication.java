package com.newsdigest.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NewsDigestApplication {

    public static void main(String[] args) {
        // the pipeline runs on ApplicationReadyEvent; exit once it is done so pooled threads are shut down
        System.exit(SpringApplication.exit(SpringApplication.run(NewsDigestApplication.class, args)));
    }
}
