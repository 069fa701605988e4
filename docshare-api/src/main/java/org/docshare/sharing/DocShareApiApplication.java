package org.docshare.sharing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DocShareApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocShareApiApplication.class, args);
    }
}
