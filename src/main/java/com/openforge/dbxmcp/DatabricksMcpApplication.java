package com.openforge.dbxmcp;

import com.openforge.dbxmcp.client.DatabricksProperties;
import com.openforge.dbxmcp.dispatch.ToolProperties;
import com.openforge.dbxmcp.mcp.McpServerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        DatabricksProperties.class,
        ToolProperties.class,
        McpServerProperties.class
})
public class DatabricksMcpApplication {

    public static void main(String[] args) {
        SpringApplication.run(DatabricksMcpApplication.class, args);
    }
}
