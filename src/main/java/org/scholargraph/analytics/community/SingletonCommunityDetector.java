package org.scholargraph.analytics.community;

import com.typesafe.config.Config;
import org.scholargraph.api.model.Graph;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Assigns each node its own community, numbered in node order.
 */
public class SingletonCommunityDetector implements ICommunityDetector {

    public SingletonCommunityDetector() {
    }

    /**
     * Allows selecting this detector by class name; it has no options.
     */
    public SingletonCommunityDetector(Config options) {
        this();
    }

    @Override
    public Map<String, Integer> detect(Graph graph) {
        Map<String, Integer> partition = new LinkedHashMap<>();
        int next = 0;
        for (String node : graph.nodeIds()) {
            partition.put(node, next++);
        }
        return partition;
    }

    @Override
    public boolean isDegenerate() {
        return true;
    }

    @Override
    public String name() {
        return "singleton";
    }
}
