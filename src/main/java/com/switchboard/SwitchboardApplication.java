package com.switchboard;

import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;

import java.util.Arrays;

@SpringBootApplication
public class SwitchboardApplication {

    public static void main(String[] args) {
        // Containers start the jar without arguments; run the server there.
        if (args.length == 0 && System.getenv("SWITCHBOARD_SERVE") != null) {
            args = new String[]{"serve"};
        }

        boolean serveMode = Arrays.asList(args).contains("serve");

        SpringApplicationBuilder builder = new SpringApplicationBuilder(SwitchboardApplication.class)
                .properties(
                        "spring.main.web-application-type=" + (serveMode ? "servlet" : "none"),
                        "spring.main.banner-mode=off");

        ApplicationContext ctx = builder.run(args);

        if (!serveMode) {
            ExitCodeGenerator exitCodeGen = ctx.getBean(ExitCodeGenerator.class);
            System.exit(SpringApplication.exit(ctx, exitCodeGen));
        }
    }
}
