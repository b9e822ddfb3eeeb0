package com.fontlint;

import com.fontlint.cli.FontLintCommand;
import com.fontlint.engine.FontLintEngine;
import com.fontlint.spring.EnableFontLint;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

/**
 * Command line entry point.
 * <p>
 * {@code --tags}, {@code --comments}, {@code --filters} list the tag catalog;
 * {@code --fonts=fonts.yaml [--rules=rules.txt] [--format=json]} shows the tests resolved
 * for each font.
 */
@SpringBootApplication
@EnableFontLint
public class FontLintApplication {

    public static void main(String[] args) {
        SpringApplication.run(FontLintApplication.class, args);
    }

    @Bean
    public ApplicationRunner fontLintRunner(FontLintEngine engine) {
        return args -> new FontLintCommand(engine, System.out).run(args);
    }
}
