package com.lorekeeper.providers;

import java.util.List;

/**
 * Orders documents by relevance to a query.
 *
 * @return indices into {@code documents}, best first; may be partial
 */
public interface RerankProvider {
    String id();
    List<Integer> rerank(String query, List<String> documents);
}
