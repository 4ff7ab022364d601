package com.project.image.comparison;

import org.springframework.boot.Banner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.Arrays;

/**
 * Entry point. With two image paths on the command line the application runs
 * one comparison without a web server and exits; otherwise it serves the
 * upload form.
 */
@SpringBootApplication
public class Application {
    public static void main(String[] args) {
        if (isCommandLineRun(args)) {
            ConfigurableApplicationContext ctx = new SpringApplicationBuilder(Application.class)
                    .web(WebApplicationType.NONE)
                    .bannerMode(Banner.Mode.OFF)
                    .headless(!Arrays.asList(args).contains("--display"))
                    .run(args);
            System.exit(SpringApplication.exit(ctx));
        }
        SpringApplication.run(Application.class, args);
    }

    /** Positional arguments are image paths; anything starting with "--" is an option. */
    static boolean isCommandLineRun(String[] args) {
        return Arrays.stream(args).anyMatch(a -> !a.startsWith("--"));
    }
}
