package com.example.pairprog;

import com.example.pairprog.repository.PersistentRoomRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
public class PairProgApplication {

    private static final Logger log = LoggerFactory.getLogger(PairProgApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(PairProgApplication.class, args);
    }

    @Bean
    public CommandLineRunner roomStoreCheck(PersistentRoomRepository repo) {
        return args -> log.info("Room store reachable: {} room(s)", repo.count());
    }
}
