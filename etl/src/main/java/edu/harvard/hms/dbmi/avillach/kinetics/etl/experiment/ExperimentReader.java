package edu.harvard.hms.dbmi.avillach.kinetics.etl.experiment;

import edu.harvard.hms.dbmi.avillach.kinetics.data.experiment.ExperimentProperties;
import edu.harvard.hms.dbmi.avillach.kinetics.data.experiment.Simulation;
import edu.harvard.hms.dbmi.avillach.kinetics.etl.experiment.config.ParserConfig;
import edu.harvard.hms.dbmi.avillach.kinetics.exception.ExperimentFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Parses an experiment document and runs it through classification, property extraction and data series extraction.
 * Holds no per-document state, so one reader can serve many threads.
 */
public class ExperimentReader {

    private static final Logger log = LoggerFactory.getLogger(ExperimentReader.class);

    private final DocumentBuilderFactory documentBuilderFactory;
    private final ExperimentClassifier classifier;
    private final PropertyExtractor propertyExtractor;
    private final DataSeriesExtractor dataSeriesExtractor;
    private final SimulationBuilder simulationBuilder;

    public ExperimentReader() {
        this(new ExperimentClassifier(), new PropertyExtractor(), new DataSeriesExtractor(), new SimulationBuilder());
    }

    public ExperimentReader(ParserConfig config) {
        this(new ExperimentClassifier(), new PropertyExtractor(), new DataSeriesExtractor(config), new SimulationBuilder());
    }

    public ExperimentReader(
        ExperimentClassifier classifier, PropertyExtractor propertyExtractor, DataSeriesExtractor dataSeriesExtractor,
        SimulationBuilder simulationBuilder
    ) {
        this.classifier = classifier;
        this.propertyExtractor = propertyExtractor;
        this.dataSeriesExtractor = dataSeriesExtractor;
        this.simulationBuilder = simulationBuilder;
        this.documentBuilderFactory = newDocumentBuilderFactory();
    }

    public List<Simulation> readSimulations(Path experimentFile) {
        Path fileName = experimentFile.getFileName();
        if (fileName == null) {
            throw new IllegalArgumentException("Experiment file " + experimentFile + " has no file name");
        }
        ExperimentProperties properties = readExperiment(experimentFile);
        return simulationBuilder.build(properties, fileName.toString());
    }

    public ExperimentProperties readExperiment(Path experimentFile) {
        log.info("Reading experiment file {}", experimentFile.toAbsolutePath());
        try (InputStream in = Files.newInputStream(experimentFile)) {
            return readExperiment(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read experiment file " + experimentFile, e);
        }
    }

    public ExperimentProperties readExperiment(InputStream in) {
        return extract(parse(in));
    }

    public ExperimentProperties extract(Element root) {
        ExperimentProperties properties = new ExperimentProperties();
        properties.setKind(classifier.classify(root));
        propertyExtractor.extractCommonProperties(properties, root);
        propertyExtractor.extractIgnitionDescriptor(properties, root);
        propertyExtractor.extractReference(properties, root);
        dataSeriesExtractor.extract(properties, root);
        log.debug("Extracted {}", properties);
        return properties;
    }

    public Element parse(InputStream in) {
        try {
            // neither the factory nor its builders are thread safe, each call gets its own builder
            DocumentBuilder documentBuilder;
            synchronized (documentBuilderFactory) {
                documentBuilder = documentBuilderFactory.newDocumentBuilder();
            }
            Document document = documentBuilder.parse(in);
            return document.getDocumentElement();
        } catch (SAXException e) {
            throw new ExperimentFormatException("Experiment document is not well-formed XML: " + e.getMessage(), e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException(e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static DocumentBuilderFactory newDocumentBuilderFactory() {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setExpandEntityReferences(false);
        factory.setXIncludeAware(false);
        try {
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support secure processing", e);
        }
        return factory;
    }
}
