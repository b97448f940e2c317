package com.mead.oncology.rdf;

import org.apache.jena.rdf.model.Property;
import org.apache.jena.rdf.model.Resource;
import org.apache.jena.rdf.model.ResourceFactory;

/**
 * Terms of the guideline graph. Ordered values (treatments, side effects, biomarkers) are RDF collections.
 */
public final class OncologyVocab {

    public static final String NS = "https://mead.example/ontology/oncology#";
    public static final String SCHEMA_NS = "https://schema.org/";

    public static final Resource GuidelineEntry = resource("GuidelineEntry");
    public static final Resource TreatmentSynonym = resource("TreatmentSynonym");
    public static final Resource TreatmentInsight = resource("TreatmentInsight");
    public static final Resource GuidelineReference = resource("GuidelineReference");

    public static final Property cancerType = property("cancerType");
    public static final Property stage = property("stage");
    public static final Property guidelineSource = property("guidelineSource");
    public static final Property evidenceLevel = property("evidenceLevel");
    public static final Property recoveryTime = property("recoveryTime");
    public static final Property standardTreatment = property("standardTreatment");
    public static final Property recommendedTreatments = property("recommendedTreatments");
    public static final Property knownTreatments = property("knownTreatments");
    public static final Property requiredBiomarkers = property("requiredBiomarkers");
    public static final Property contraindications = property("contraindications");
    public static final Property notes = property("notes");

    public static final Property survival = property("survival");
    public static final Property measure = property("measure");
    public static final Property low = property("low");
    public static final Property high = property("high");
    public static final Property unit = property("unit");

    public static final Property treatmentProfile = property("treatmentProfile");
    public static final Property treatment = property("treatment");
    public static final Property sideEffects = property("sideEffects");
    public static final Property alternatives = property("alternatives");
    public static final Property cost = property("cost");
    public static final Property inrMin = property("inrMin");
    public static final Property inrMax = property("inrMax");
    public static final Property usdMin = property("usdMin");
    public static final Property usdMax = property("usdMax");
    public static final Property billingPeriod = property("billingPeriod");

    public static final Property alias = property("alias");
    public static final Property canonicalTreatment = property("canonicalTreatment");

    public static final Property urgency = property("urgency");
    public static final Property myths = property("myths");
    public static final Property myth = property("myth");
    public static final Property fact = property("fact");

    public static final Property referenceName = property("referenceName");

    public static final Property url = ResourceFactory.createProperty(SCHEMA_NS, "url");

    private static Resource resource(String localName) {
        return ResourceFactory.createResource(NS + localName);
    }

    private static Property property(String localName) {
        return ResourceFactory.createProperty(NS, localName);
    }

    private OncologyVocab() {}
}
