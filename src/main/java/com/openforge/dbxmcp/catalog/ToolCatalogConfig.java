package com.openforge.dbxmcp.catalog;

import com.openforge.dbxmcp.dispatch.ToolProperties;
import com.openforge.dbxmcp.normalize.ResponseNormalizer;
import com.openforge.dbxmcp.tool.ParameterSpec;
import com.openforge.dbxmcp.tool.ToolDescriptor;
import com.openforge.dbxmcp.tool.ToolHandler;
import com.openforge.dbxmcp.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the frozen {@link ToolRegistry} from the operation catalog.
 *
 * Each operation becomes one tool. Operations naming a {@code handler} are wrapped by the
 * {@link OperationHandler} bean of that name; an unknown handler name fails startup.
 */
@Slf4j
@Configuration
public class ToolCatalogConfig {

    @Bean
    public ToolRegistry toolRegistry(CatalogLoader catalogLoader,
                                     ToolProperties toolProperties,
                                     ResponseNormalizer normalizer,
                                     Map<String, OperationHandler> operationHandlers) {
        List<ApiOperation> operations = catalogLoader.load(toolProperties.catalogLocation());
        return buildRegistry(operations, normalizer, operationHandlers);
    }

    static ToolRegistry buildRegistry(List<ApiOperation> operations,
                                      ResponseNormalizer normalizer,
                                      Map<String, OperationHandler> operationHandlers) {
        ToolRegistry registry = new ToolRegistry();
        for (ApiOperation op : operations) {
            registry.register(toDescriptor(op, normalizer, operationHandlers));
        }
        registry.freeze();
        return registry;
    }

    private static ToolDescriptor toDescriptor(ApiOperation op,
                                               ResponseNormalizer normalizer,
                                               Map<String, OperationHandler> operationHandlers) {
        EndpointToolHandler endpoint = new EndpointToolHandler(op, normalizer);
        ToolHandler handler = endpoint;
        if (op.handler() != null) {
            OperationHandler custom = operationHandlers.get(op.handler());
            if (custom == null) {
                throw new CatalogException("operation %s names handler '%s' but no such bean exists (known: %s)"
                        .formatted(op.name(), op.handler(), operationHandlers.keySet()));
            }
            handler = (arguments, context) -> custom.handle(endpoint, arguments, context);
            log.debug("[Catalog] {} → custom handler {}", op.name(), op.handler());
        }

        Map<String, ParameterSpec> parameters = new LinkedHashMap<>();
        op.parameters().forEach(p -> parameters.put(p.name(), p.toSpec()));

        return ToolDescriptor.builder()
                .name(op.name())
                .description(op.description())
                .parameters(parameters)
                .handler(handler)
                .returns(op.returnsOrDefault())
                .longRunning(op.longRunning())
                .build();
    }
}
