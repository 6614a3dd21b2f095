package edu.harvard.hms.dbmi.avillach.kinetics.etl.experiment;

import edu.harvard.hms.dbmi.avillach.kinetics.data.experiment.ExperimentProperties;
import edu.harvard.hms.dbmi.avillach.kinetics.data.experiment.IgnitionType;
import edu.harvard.hms.dbmi.avillach.kinetics.data.experiment.Quantity;
import edu.harvard.hms.dbmi.avillach.kinetics.exception.ExperimentFormatException;
import edu.harvard.hms.dbmi.avillach.kinetics.exception.MissingIgnitionDefinitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import java.util.Optional;

/**
 * Reads the document level properties of an experiment: initial conditions shared by every data point, the ignition
 * criterion and the bibliographic source.
 */
public class PropertyExtractor {

    private static final Logger log = LoggerFactory.getLogger(PropertyExtractor.class);

    private static final String PRESSURE = "pressure";
    private static final String PRESSURE_RISE = "pressure rise";
    private static final String INITIAL_COMPOSITION = "initial composition";

    /**
     * Adds {@code pressure}, {@code pressure rise} and {@code composition} from the {@code commonProperties} block. Any
     * of them may be absent; whether that is acceptable depends on the experiment kind and is checked when simulations
     * are built.
     */
    public ExperimentProperties extractCommonProperties(ExperimentProperties properties, Element root) {
        Optional<Element> commonProperties = XmlElementUtil.firstChild(root, "commonProperties");
        if (commonProperties.isEmpty()) {
            log.debug("Document has no commonProperties block");
            return properties;
        }

        for (Element property : XmlElementUtil.children(commonProperties.get(), "property")) {
            String name = XmlElementUtil.attribute(property, "name").orElse("");
            switch (name) {
                case PRESSURE -> properties.setPressure(parseScalar(property, name));
                case PRESSURE_RISE -> properties.setPressureRise(parseScalar(property, name));
                case INITIAL_COMPOSITION -> parseComposition(property, properties);
                default -> log.debug("Ignoring common property {}", name);
            }
        }
        return properties;
    }

    /**
     * Adds {@code ignition target}, {@code ignition type} and, when the document states a threshold,
     * {@code ignition target value}.
     *
     * @throws MissingIgnitionDefinitionException if there is no usable {@code ignitionType} element
     */
    public ExperimentProperties extractIgnitionDescriptor(ExperimentProperties properties, Element root) {
        Element ignitionType = XmlElementUtil.firstChild(root, "ignitionType")
            .orElseThrow(() -> new MissingIgnitionDefinitionException("Document has no ignitionType element"));

        String rawTarget = XmlElementUtil.attribute(ignitionType, "target").orElse("");
        // targets are written as a ';' terminated list, e.g. "OH;"
        String target = rawTarget.endsWith(";") ? rawTarget.substring(0, rawTarget.length() - 1).trim() : rawTarget;
        if (target.isEmpty()) {
            throw new MissingIgnitionDefinitionException("ignitionType does not name a target");
        }
        if (target.contains(";")) {
            throw new MissingIgnitionDefinitionException("Only a single ignition target is supported, got \"" + rawTarget + "\"");
        }

        String rawType = XmlElementUtil.attribute(ignitionType, "type").orElse("");
        IgnitionType type = IgnitionType.fromLabel(rawType).orElseThrow(
            () -> new MissingIgnitionDefinitionException("Ignition type \"" + rawType + "\" for target " + target + " is not supported")
        );

        properties.setIgnitionTarget(target).setIgnitionType(type);

        Optional<String> amount = XmlElementUtil.attribute(ignitionType, "amount");
        if (amount.isPresent()) {
            try {
                properties.setIgnitionTargetValue(Double.parseDouble(amount.get()));
            } catch (NumberFormatException e) {
                throw new MissingIgnitionDefinitionException("Ignition target value \"" + amount.get() + "\" is not a number", e);
            }
        }
        return properties;
    }

    /**
     * Adds {@code reference} and {@code file author} when the document carries them.
     */
    public ExperimentProperties extractReference(ExperimentProperties properties, Element root) {
        XmlElementUtil.childText(root, "bibliographySource").filter(s -> !s.isEmpty()).ifPresent(properties::setReference);
        XmlElementUtil.childText(root, "fileAuthor").filter(s -> !s.isEmpty()).ifPresent(properties::setFileAuthor);
        return properties;
    }

    private void parseComposition(Element property, ExperimentProperties properties) {
        for (Element component : XmlElementUtil.children(property, "component")) {
            String species = XmlElementUtil.firstChild(component, "speciesLink")
                .flatMap(link -> XmlElementUtil.attribute(link, "preferredKey"))
                .orElseThrow(() -> new ExperimentFormatException("Composition component has no speciesLink preferredKey"));
            String amount = XmlElementUtil.childText(component, "amount")
                .filter(s -> !s.isEmpty())
                .orElseThrow(() -> new ExperimentFormatException("Composition component " + species + " has no amount"));
            properties.putComponent(species, amount);
        }
    }

    private Quantity parseScalar(Element property, String name) {
        String units = XmlElementUtil.attribute(property, "units")
            .orElseThrow(() -> new ExperimentFormatException("Common property \"" + name + "\" has no units"));
        String value = XmlElementUtil.childText(property, "value").orElse("");
        try {
            return Quantity.of(Double.parseDouble(value), units);
        } catch (NumberFormatException e) {
            throw new ExperimentFormatException("Common property \"" + name + "\" has a non-numeric value. Value = \"" + value + "\"", e);
        }
    }
}
