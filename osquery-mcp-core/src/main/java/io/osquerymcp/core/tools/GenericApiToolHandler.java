package io.osquerymcp.core.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import io.osquerymcp.core.OsQueryObjectMappers;
import io.osquerymcp.core.args.GenericApiParams;
import io.osquerymcp.core.args.ToolArguments;
import io.osquerymcp.core.client.ApiRequest;
import io.osquerymcp.core.client.OpenSearchClient;
import io.osquerymcp.core.compat.CompatibilityGate;

/**
 * GenericOpenSearchApiTool: sends the caller's request unchanged and returns
 * whatever the cluster answers.
 */
public class GenericApiToolHandler extends AbstractToolHandler<GenericApiParams> {

    private static final ObjectMapper MAPPER = OsQueryObjectMappers.create();

    public GenericApiToolHandler(CompatibilityGate gate, OpenSearchClient client) {
        super(OpenSearchToolCatalog.GENERIC_API, "Error calling OpenSearch API", gate, client);
    }

    @Override
    protected Object call(ToolArguments<GenericApiParams> arguments) {
        GenericApiParams params = arguments.params();
        ApiRequest request = new ApiRequest(
            params.verb(),
            params.normalizedPath(),
            params.queryParams(),
            toBody(params.body()),
            params.headers()
        );
        return client.execute(arguments.cluster(), request);
    }

    static JsonNode toBody(Object body) {
        if (body == null) {
            return null;
        }
        if (body instanceof String) {
            return TextNode.valueOf((String) body);
        }
        return MAPPER.valueToTree(body);
    }
}
