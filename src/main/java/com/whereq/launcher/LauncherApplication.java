package com.whereq.launcher;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Profiles;

/**
 * Main application class for WhereQ Launcher.
 * Resolves an environment-specific job configuration, validates the artifacts and resources
 * a batch Spark job needs, and dispatches it to the cluster master.
 * <p>
 * By default the application runs once as a command line tool and exits with a code that
 * reflects the submission outcome. With the {@code server} profile it keeps running and
 * exposes the same launch operation over HTTP.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
public class LauncherApplication {

    public static final String SERVER_PROFILE = "server";

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(LauncherApplication.class, args);
        if (context.getEnvironment().acceptsProfiles(Profiles.of(SERVER_PROFILE))) {
            return;
        }
        System.exit(SpringApplication.exit(context));
    }
}
