package com.mead.oncology.rdf;

import com.mead.oncology.exception.MalformedKnowledgeBaseException;
import lombok.Getter;
import org.apache.jena.query.Dataset;
import org.apache.jena.query.DatasetFactory;
import org.apache.jena.rdf.model.Model;
import org.apache.jena.rdf.model.ModelFactory;
import org.apache.jena.riot.Lang;
import org.apache.jena.riot.RDFDataMgr;
import org.apache.jena.riot.RiotException;
import org.apache.jena.shacl.ShaclValidator;
import org.apache.jena.shacl.Shapes;
import org.apache.jena.shacl.ValidationReport;
import org.apache.jena.shacl.validation.ReportEntry;
import org.apache.jena.system.Txn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * Reads the guideline Turtle file into a transactional dataset and checks it against the SHACL shapes.
 */
@Service
public class GuidelineGraphLoader {

    private static final Logger log = LoggerFactory.getLogger(GuidelineGraphLoader.class);

    private static final int VERSION_HEX_LENGTH = 12;

    @Getter
    private final Resource dataFile;

    @Getter
    private final Resource shapesFile;

    public GuidelineGraphLoader(@Value("${mead.oncology.kb.data-file}") Resource dataFile,
                                @Value("${mead.oncology.kb.shapes-file}") Resource shapesFile) {
        this.dataFile = dataFile;
        this.shapesFile = shapesFile;
    }

    public record LoadedGraph(
            Dataset dataset,
            String version,
            String source
    ) {}

    /**
     * Loads a fresh dataset on every call; previously returned datasets are left untouched.
     *
     * @throws MalformedKnowledgeBaseException if the file cannot be read or parsed, or violates the shapes
     */
    public LoadedGraph load() {
        String source = dataFile.getDescription();
        byte[] content = readAll(dataFile);

        // Dataset (instead of plain Model) lets readers use read transactions.
        Dataset dataset = DatasetFactory.createTxnMem();
        try {
            Txn.executeWrite(dataset, () ->
                    RDFDataMgr.read(dataset.getDefaultModel(), new ByteArrayInputStream(content), Lang.TURTLE));
        } catch (RiotException e) {
            throw new MalformedKnowledgeBaseException("Failed to parse guideline file " + source, e);
        }

        validateShapes(dataset, source);

        String version = digest(content);
        log.info("Loaded guideline graph from {} (version {})", source, version);
        return new LoadedGraph(dataset, version, source);
    }

    private void validateShapes(Dataset dataset, String source) {
        Model shapesModel = ModelFactory.createDefaultModel();
        try (InputStream in = shapesFile.getInputStream()) {
            RDFDataMgr.read(shapesModel, in, Lang.TURTLE);
        } catch (IOException | RiotException e) {
            throw new MalformedKnowledgeBaseException("Failed to load SHACL shapes " + shapesFile.getDescription(), e);
        }

        Shapes shapes = Shapes.parse(shapesModel.getGraph());
        ValidationReport report = Txn.calculateRead(dataset, () ->
                ShaclValidator.get().validate(shapes, dataset.getDefaultModel().getGraph()));

        if (!report.conforms()) {
            List<String> violations = report.getEntries().stream()
                    .map(GuidelineGraphLoader::describe)
                    .toList();
            throw new MalformedKnowledgeBaseException(source, violations);
        }
    }

    private static String describe(ReportEntry entry) {
        return entry.focusNode() + " " + entry.resultPath() + ": " + entry.message();
    }

    private static byte[] readAll(Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new MalformedKnowledgeBaseException("Failed to read guideline file " + resource.getDescription(), e);
        }
    }

    private static String digest(byte[] content) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(content);
            return HexFormat.of().formatHex(hash).substring(0, VERSION_HEX_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
