package io.osquerymcp.core.tools;

import com.fasterxml.jackson.databind.JsonNode;
import io.osquerymcp.core.args.ListIndicesParams;
import io.osquerymcp.core.args.ToolArguments;
import io.osquerymcp.core.client.OpenSearchClient;
import io.osquerymcp.core.compat.CompatibilityGate;

import java.util.ArrayList;
import java.util.List;

/**
 * ListIndexTool.
 *
 * <ul>
 *   <li>With an index name: returns that index's detail ({@code GET /{index}}); the
 *       listing is never requested.</li>
 *   <li>Without, and {@code include_detail=false}: returns index names only. Rows
 *       that are not objects or lack an {@code index} field are dropped.</li>
 *   <li>Without, and {@code include_detail=true}: returns the cat.indices rows as-is.</li>
 * </ul>
 */
public class ListIndicesToolHandler extends AbstractToolHandler<ListIndicesParams> {

    public ListIndicesToolHandler(CompatibilityGate gate, OpenSearchClient client) {
        super(OpenSearchToolCatalog.LIST_INDICES, "Error listing indices", gate, client);
    }

    @Override
    protected Object call(ToolArguments<ListIndicesParams> arguments) {
        ListIndicesParams params = arguments.params();
        if (params.hasIndex()) {
            return client.getIndex(arguments.cluster(), params.index().trim());
        }

        JsonNode indices = client.listIndices(arguments.cluster());
        if (params.includeDetail()) {
            return indices;
        }
        return indexNames(indices);
    }

    static List<String> indexNames(JsonNode indices) {
        List<String> names = new ArrayList<>();
        for (JsonNode row : indices) {
            if (row.path("index").isTextual()) {
                names.add(row.get("index").asText());
            }
        }
        return names;
    }
}
