package com.lorekeeper.memory;

import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.KnnFloatVectorField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.Term;
import org.apache.lucene.index.VectorSimilarityFunction;
import org.apache.lucene.search.FieldExistsQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.KnnFloatVectorQuery;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Lucene HNSW mirror of the record log. Each dimension gets its own vector
 * field ({@code vec_<dim>}) so that a query only ever meets vectors of its own length.
 */
class KnnIndex implements AutoCloseable {

    record Hit(String id, double distance) {}

    // Lucene's default codec refuses wider vectors.
    static final int MAX_DIMENSIONS = 1024;

    private final Directory directory;
    private final IndexWriter writer;

    KnnIndex(Path path) throws IOException {
        this(openDirectory(path));
    }

    /** Takes ownership of {@code directory}; it is closed here if the writer cannot be opened. */
    KnnIndex(Directory directory) throws IOException {
        this.directory = directory;
        var config = new IndexWriterConfig();
        config.setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
        try {
            this.writer = new IndexWriter(directory, config);
        } catch (IOException | RuntimeException e) {
            try {
                directory.close();
            } catch (IOException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
    }

    private static Directory openDirectory(Path path) throws IOException {
        Files.createDirectories(path);
        return FSDirectory.open(path);
    }

    static String field(int dimension) {
        return "vec_" + dimension;
    }

    void add(String id, String owner, float[] vector) throws IOException {
        if (vector.length > MAX_DIMENSIONS) {
            throw new IllegalArgumentException(vector.length + " dims exceeds index limit " + MAX_DIMENSIONS);
        }
        var doc = new Document();
        doc.add(new StringField("id", id, Field.Store.YES));
        doc.add(new StringField("owner", owner, Field.Store.NO));
        doc.add(new KnnFloatVectorField(field(vector.length), vector, VectorSimilarityFunction.COSINE));
        writer.updateDocument(new Term("id", id), doc);
        writer.commit();
    }

    void deleteOwner(String owner) throws IOException {
        writer.deleteDocuments(new Term("owner", owner));
        writer.commit();
    }

    void clear() throws IOException {
        writer.deleteAll();
        writer.commit();
    }

    /** Live documents carrying a vector of this dimension. */
    int count(int dimension) throws IOException {
        try (var reader = DirectoryReader.open(writer)) {
            return new IndexSearcher(reader).count(new FieldExistsQuery(field(dimension)));
        }
    }

    int liveDocs() throws IOException {
        try (var reader = DirectoryReader.open(writer)) {
            return reader.numDocs();
        }
    }

    /** Cosine score {@code (1+cos)/2} converted back to {@code 1 - cos}. */
    List<Hit> search(float[] vector, int k) throws IOException {
        try (var reader = DirectoryReader.open(writer)) {
            var searcher = new IndexSearcher(reader);
            var hits = searcher.search(new KnnFloatVectorQuery(field(vector.length), vector, k), k);
            var out = new ArrayList<Hit>(hits.scoreDocs.length);
            var stored = searcher.storedFields();
            for (var hit : hits.scoreDocs) {
                var id = stored.document(hit.doc).get("id");
                out.add(new Hit(id, 2.0 - 2.0 * hit.score));
            }
            return out;
        }
    }

    @Override
    public void close() throws IOException {
        writer.close();
        directory.close();
    }
}
