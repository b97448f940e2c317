package com.mead.oncology.repository;

import com.mead.oncology.engine.TreatmentNormalizer;
import com.mead.oncology.exception.MalformedKnowledgeBaseException;
import com.mead.oncology.model.CancerType;
import com.mead.oncology.model.CostEstimate;
import com.mead.oncology.model.GuidelineEntry;
import com.mead.oncology.model.GuidelineReference;
import com.mead.oncology.model.KnowledgeBase;
import com.mead.oncology.model.MoneyRange;
import com.mead.oncology.model.MythFact;
import com.mead.oncology.model.SurvivalStats;
import com.mead.oncology.model.TreatmentInsight;
import com.mead.oncology.rdf.GuidelineGraphLoader;
import com.mead.oncology.rdf.GuidelineGraphLoader.LoadedGraph;
import com.mead.oncology.rdf.OncologyVocab;
import jakarta.annotation.PostConstruct;
import org.apache.jena.query.Dataset;
import org.apache.jena.query.QueryExecution;
import org.apache.jena.query.QueryExecutionFactory;
import org.apache.jena.query.QuerySolution;
import org.apache.jena.query.ResultSet;
import org.apache.jena.rdf.model.Literal;
import org.apache.jena.rdf.model.Property;
import org.apache.jena.rdf.model.RDFList;
import org.apache.jena.rdf.model.RDFNode;
import org.apache.jena.rdf.model.Resource;
import org.apache.jena.rdf.model.Statement;
import org.apache.jena.rdf.model.StmtIterator;
import org.apache.jena.system.Txn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Holds the current knowledge base snapshot. The snapshot is built completely before it is published, so
 * readers see either the previous snapshot or the new one, never a partial one.
 */
@Component
public class GuidelineRepository {

    private static final Logger log = LoggerFactory.getLogger(GuidelineRepository.class);

    private static final String ENTRY_QUERY = """
            PREFIX onco: <https://mead.example/ontology/oncology#>
            PREFIX schema: <https://schema.org/>
            SELECT ?entry ?cancerType ?stage ?source ?url ?evidence ?recovery ?standard WHERE {
              ?entry a onco:GuidelineEntry ;
                     onco:cancerType ?cancerType ;
                     onco:stage ?stage ;
                     onco:guidelineSource ?source ;
                     schema:url ?url .
              OPTIONAL { ?entry onco:evidenceLevel ?evidence . }
              OPTIONAL { ?entry onco:recoveryTime ?recovery . }
              OPTIONAL { ?entry onco:standardTreatment ?standard . }
            }
            ORDER BY ?cancerType ?stage
            """;

    private static final String SYNONYM_QUERY = """
            PREFIX onco: <https://mead.example/ontology/oncology#>
            SELECT ?alias ?canonical WHERE {
              ?synonym a onco:TreatmentSynonym ;
                       onco:alias ?alias ;
                       onco:canonicalTreatment ?canonical .
            }
            ORDER BY ?alias
            """;

    private static final String INSIGHT_QUERY = """
            PREFIX onco: <https://mead.example/ontology/oncology#>
            SELECT ?insight ?treatment ?urgency WHERE {
              ?insight a onco:TreatmentInsight ;
                       onco:treatment ?treatment .
              OPTIONAL { ?insight onco:urgency ?urgency . }
            }
            ORDER BY ?treatment
            """;

    private static final String REFERENCE_QUERY = """
            PREFIX onco: <https://mead.example/ontology/oncology#>
            PREFIX schema: <https://schema.org/>
            SELECT ?name ?url WHERE {
              ?reference a onco:GuidelineReference ;
                         onco:referenceName ?name ;
                         schema:url ?url .
            }
            ORDER BY ?name
            """;

    private final GuidelineGraphLoader loader;
    private final KnowledgeBaseIntegrityChecker integrityChecker;
    private final Clock clock;
    private volatile KnowledgeBase snapshot;

    @Autowired
    public GuidelineRepository(GuidelineGraphLoader loader, KnowledgeBaseIntegrityChecker integrityChecker) {
        this(loader, integrityChecker, Clock.systemUTC());
    }

    GuidelineRepository(GuidelineGraphLoader loader, KnowledgeBaseIntegrityChecker integrityChecker, Clock clock) {
        this.loader = loader;
        this.integrityChecker = integrityChecker;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        refresh();
    }

    /**
     * Loads and validates a new snapshot and swaps it in. On failure the current snapshot stays in place
     * and the error propagates.
     */
    public synchronized KnowledgeBase refresh() {
        LoadedGraph graph = loader.load();
        List<String> readViolations = new ArrayList<>();
        List<GuidelineEntry> entries = readEntries(graph.dataset(), readViolations);
        Map<String, String> synonyms = readSynonyms(graph.dataset(), readViolations);
        List<TreatmentInsight> insights = readInsights(graph.dataset());
        List<GuidelineReference> references = readReferences(graph.dataset());

        integrityChecker.check(graph.source(), entries, synonyms, insights, readViolations);

        KnowledgeBase loaded = new KnowledgeBase(graph.version(), graph.source(), Instant.now(clock),
                entries, synonyms, insights, references);
        snapshot = loaded;
        log.info("Knowledge base {} ready: {} guideline entries, {} treatment synonyms, {} treatment insights",
                loaded.getVersion(), loaded.size(), synonyms.size(), insights.size());
        return loaded;
    }

    public KnowledgeBase snapshot() {
        KnowledgeBase current = snapshot;
        if (current == null) {
            throw new IllegalStateException("Knowledge base has not been loaded");
        }
        return current;
    }

    private List<GuidelineEntry> readEntries(Dataset dataset, List<String> violations) {
        return Txn.calculateRead(dataset, () -> {
            List<GuidelineEntry> entries = new ArrayList<>();

            try (QueryExecution queryExecution = QueryExecutionFactory.create(ENTRY_QUERY, dataset)) {
                ResultSet resultSet = queryExecution.execSelect();
                while (resultSet.hasNext()) {
                    QuerySolution row = resultSet.next();
                    Resource entry = row.getResource("entry");
                    entries.add(toEntry(entry, row, violations));
                }
            }
            return entries;
        });
    }

    private GuidelineEntry toEntry(Resource entry, QuerySolution row, List<String> violations) {
        String cancerTypeName = row.getLiteral("cancerType").getString();
        CancerType cancerType;
        try {
            cancerType = CancerType.valueOf(cancerTypeName);
        } catch (IllegalArgumentException e) {
            throw new MalformedKnowledgeBaseException("Unknown cancer type '" + cancerTypeName + "' on " + entry, e);
        }

        String stage = row.getLiteral("stage").getString();
        Map<String, List<String>> riskProfile = new LinkedHashMap<>();
        Map<String, CostEstimate> costEstimate = new LinkedHashMap<>();
        Map<String, List<String>> alternatives = new LinkedHashMap<>();
        Set<String> profiled = new HashSet<>();

        for (Resource profile : profilesOf(entry)) {
            String treatment = profile.getRequiredProperty(OncologyVocab.treatment).getString();
            if (!profiled.add(treatment)) {
                violations.add(cancerType + "/" + stage + ": treatment '" + treatment
                        + "' has more than one treatment profile");
                continue;
            }
            if (profile.hasProperty(OncologyVocab.sideEffects)) {
                riskProfile.put(treatment, readList(profile, OncologyVocab.sideEffects));
            }
            if (profile.hasProperty(OncologyVocab.alternatives)) {
                alternatives.put(treatment, readList(profile, OncologyVocab.alternatives));
            }
            Resource cost = profile.getPropertyResourceValue(OncologyVocab.cost);
            if (cost != null) {
                costEstimate.put(treatment, toCost(cost));
            }
        }

        return new GuidelineEntry(
                cancerType,
                stage,
                row.getLiteral("source").getString(),
                readNodeValue(row.get("url")),
                readNodeValue(row.get("evidence")),
                readNodeValue(row.get("recovery")),
                readNodeValue(row.get("standard")),
                readList(entry, OncologyVocab.recommendedTreatments),
                readList(entry, OncologyVocab.knownTreatments),
                readList(entry, OncologyVocab.requiredBiomarkers),
                toSurvival(entry.getPropertyResourceValue(OncologyVocab.survival)),
                riskProfile,
                costEstimate,
                alternatives,
                readList(entry, OncologyVocab.contraindications),
                readList(entry, OncologyVocab.notes)
        );
    }

    // Profiles are unordered in RDF; sort by treatment so every load yields the same map order.
    private static List<Resource> profilesOf(Resource entry) {
        List<Resource> profiles = new ArrayList<>();
        StmtIterator statements = entry.listProperties(OncologyVocab.treatmentProfile);
        try {
            while (statements.hasNext()) {
                Statement statement = statements.next();
                profiles.add(statement.getResource());
            }
        } finally {
            statements.close();
        }
        profiles.sort(Comparator.comparing(profile -> profile.getRequiredProperty(OncologyVocab.treatment).getString()));
        return profiles;
    }

    private static CostEstimate toCost(Resource cost) {
        return new CostEstimate(
                new MoneyRange(MoneyRange.INR, longValue(cost, OncologyVocab.inrMin), longValue(cost, OncologyVocab.inrMax)),
                new MoneyRange(MoneyRange.USD, longValue(cost, OncologyVocab.usdMin), longValue(cost, OncologyVocab.usdMax)),
                cost.getRequiredProperty(OncologyVocab.billingPeriod).getString()
        );
    }

    private static SurvivalStats toSurvival(Resource survival) {
        return new SurvivalStats(
                survival.getRequiredProperty(OncologyVocab.measure).getString(),
                survival.getRequiredProperty(OncologyVocab.low).getDouble(),
                survival.getRequiredProperty(OncologyVocab.high).getDouble(),
                survival.getRequiredProperty(OncologyVocab.unit).getString()
        );
    }

    private static long longValue(Resource resource, Property property) {
        return resource.getRequiredProperty(property).getLong();
    }

    private static List<String> readList(Resource resource, Property property) {
        Resource head = resource.getPropertyResourceValue(property);
        if (head == null) return List.of();
        List<String> values = new ArrayList<>();
        for (RDFNode node : head.as(RDFList.class).asJavaList()) {
            values.add(readNodeValue(node));
        }
        return values;
    }

    private Map<String, String> readSynonyms(Dataset dataset, List<String> violations) {
        return Txn.calculateRead(dataset, () -> {
            Map<String, String> synonyms = new LinkedHashMap<>();
            try (QueryExecution queryExecution = QueryExecutionFactory.create(SYNONYM_QUERY, dataset)) {
                ResultSet resultSet = queryExecution.execSelect();
                while (resultSet.hasNext()) {
                    QuerySolution row = resultSet.next();
                    Literal alias = row.getLiteral("alias");
                    Literal canonical = row.getLiteral("canonical");
                    String key = TreatmentNormalizer.normalize(alias.getString());
                    if (synonyms.containsKey(key)) {
                        violations.add("synonym alias '" + alias.getString() + "' is declared more than once");
                        continue;
                    }
                    synonyms.put(key, canonical.getString());
                }
            }
            return synonyms;
        });
    }

    private List<TreatmentInsight> readInsights(Dataset dataset) {
        return Txn.calculateRead(dataset, () -> {
            List<TreatmentInsight> insights = new ArrayList<>();
            try (QueryExecution queryExecution = QueryExecutionFactory.create(INSIGHT_QUERY, dataset)) {
                ResultSet resultSet = queryExecution.execSelect();
                while (resultSet.hasNext()) {
                    QuerySolution row = resultSet.next();
                    Resource insight = row.getResource("insight");
                    insights.add(new TreatmentInsight(
                            row.getLiteral("treatment").getString(),
                            readNodeValue(row.get("urgency")),
                            readMyths(insight)));
                }
            }
            return insights;
        });
    }

    private static List<MythFact> readMyths(Resource insight) {
        Resource head = insight.getPropertyResourceValue(OncologyVocab.myths);
        if (head == null) return List.of();
        List<MythFact> myths = new ArrayList<>();
        for (RDFNode node : head.as(RDFList.class).asJavaList()) {
            Resource myth = node.asResource();
            myths.add(new MythFact(
                    myth.getRequiredProperty(OncologyVocab.myth).getString(),
                    myth.getRequiredProperty(OncologyVocab.fact).getString()));
        }
        return myths;
    }

    private List<GuidelineReference> readReferences(Dataset dataset) {
        return Txn.calculateRead(dataset, () -> {
            List<GuidelineReference> references = new ArrayList<>();
            try (QueryExecution queryExecution = QueryExecutionFactory.create(REFERENCE_QUERY, dataset)) {
                ResultSet resultSet = queryExecution.execSelect();
                while (resultSet.hasNext()) {
                    QuerySolution row = resultSet.next();
                    references.add(new GuidelineReference(
                            row.getLiteral("name").getString(),
                            readNodeValue(row.get("url"))));
                }
            }
            return references;
        });
    }

    private static String readNodeValue(RDFNode node) {
        if (node == null) return null;
        if (node.isLiteral()) return node.asLiteral().getString();
        if (node.isResource()) return node.asResource().getURI();
        return node.toString();
    }
}
