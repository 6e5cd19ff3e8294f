package com.fops;

import com.fops.core.health.HealthStatus;
import com.fops.core.health.ToolchainHealthService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Boots the proposal pipeline without a web server. Front ends embed the context
 * and call {@link com.fops.core.engine.ChangeProposalOrchestrator}; run on its own
 * it reports toolchain health and exits non-zero when a component is down.
 */
@SpringBootApplication
public class FopsApplication {

    private static final Logger log = LoggerFactory.getLogger(FopsApplication.class);

    public static void main(String[] args) {
        ConfigurableApplicationContext ctx = new SpringApplicationBuilder(FopsApplication.class)
                .properties(
                        "spring.main.web-application-type=none",
                        "spring.main.banner-mode=off")
                .run(args);

        boolean down = false;
        for (HealthStatus status : ctx.getBean(ToolchainHealthService.class).checkAll()) {
            log.info("{}: {} ({})", status.component(), status.status(), status.detail());
            down |= status.isDown();
        }
        int exitCode = down ? 1 : 0;
        System.exit(SpringApplication.exit(ctx, () -> exitCode));
    }
}
