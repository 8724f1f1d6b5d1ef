package com.logic;

import com.logic.exception.LogicException;
import com.logic.spring.EnableLogicSimplifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

/**
 * Spring Boot application that simplifies each command-line argument.
 * <p>
 * Usage: {@code java -jar logic-simplifier.jar "(A or (not A)) and B" "not True"}
 */
@SpringBootApplication
@EnableLogicSimplifier
public class LogicApplication {

    private static final Logger log = LoggerFactory.getLogger(LogicApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(LogicApplication.class, args);
    }

    @Bean
    public CommandLineRunner simplifyArguments(LogicSimplifier logicSimplifier) {
        return args -> {
            for (String arg : args) {
                if (arg.startsWith("--")) {
                    continue; // Spring property override
                }
                try {
                    log.info("{} = {}", arg, logicSimplifier.simplify(arg));
                } catch (LogicException e) {
                    log.error("Cannot simplify '{}': {}", arg, e.getMessage());
                }
            }
        };
    }
}
