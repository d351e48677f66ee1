package fun.fengwk.stay.cli.search;

import fun.fengwk.stay.core.mcp.StaySearchMcp;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

/**
 * @author fengwk
 */
@SpringBootApplication(scanBasePackages = "fun.fengwk.stay")
public class StaySearchApplication {

    public static void main(String[] args) {
        SpringApplication.run(StaySearchApplication.class, args);
    }

    @Bean
    @ConditionalOnProperty(prefix = "spring.ai.mcp.server", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ToolCallbackProvider staySearchTools(StaySearchMcp staySearchMcp) {
        return MethodToolCallbackProvider.builder()
            .toolObjects(staySearchMcp)
            .build();
    }

}
