package com.flamingo.ai.literatureingest.pipeline;

import com.flamingo.ai.literatureingest.document.DocumentAssembler;
import com.flamingo.ai.literatureingest.document.chunking.DocumentChunker;
import com.flamingo.ai.literatureingest.fulltext.FullTextRetriever;
import com.flamingo.ai.literatureingest.index.ChunkIndexer;
import com.flamingo.ai.literatureingest.pubmed.LiteratureSearchClient;
import com.flamingo.ai.literatureingest.pubmed.RecordMetadataFetcher;

/** The per-record processing steps a worker runs, in pipeline order. */
public record PipelineStages(
    LiteratureSearchClient searchClient,
    RecordMetadataFetcher metadataFetcher,
    FullTextRetriever fullTextRetriever,
    DocumentAssembler assembler,
    DocumentChunker chunker,
    ChunkIndexer indexer) {}
