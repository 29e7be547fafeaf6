package eu.virtualparadox.docsearch.search.service;

import eu.virtualparadox.docsearch.index.KnowledgeIndex;
import eu.virtualparadox.docsearch.search.model.SearchResult;

import java.util.List;

public interface SearchService {

    List<SearchResult> search(final KnowledgeIndex index, final String query, final int topK);

}
