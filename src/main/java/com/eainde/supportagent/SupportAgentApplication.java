package com.eainde.supportagent;

import com.eainde.supportagent.cli.SupportCommandRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SupportAgentApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(SupportAgentApplication.class);
        // --demo / --input are one-shot console runs; no HTTP server for those.
        if (SupportCommandRunner.isCommandLineRun(args)) {
            application.setWebApplicationType(WebApplicationType.NONE);
        }
        application.run(args);
    }

}
