package edu.harvard.hms.dbmi.avillach.kinetics.etl.experiment;

import edu.harvard.hms.dbmi.avillach.kinetics.data.experiment.ExperimentKind;
import edu.harvard.hms.dbmi.avillach.kinetics.exception.UnrecognizedExperimentKindException;
import org.w3c.dom.Element;

import java.util.Optional;

public class ExperimentClassifier {

    static final String IGNITION_DELAY_MEASUREMENT = "Ignition delay measurement";

    public ExperimentKind classify(Element root) {
        Optional<String> experimentType = XmlElementUtil.childText(root, "experimentType");
        if (experimentType.isPresent() && !IGNITION_DELAY_MEASUREMENT.equalsIgnoreCase(experimentType.get())) {
            throw new UnrecognizedExperimentKindException(experimentType.get());
        }

        String apparatusKind = XmlElementUtil.firstChild(root, "apparatus").flatMap(apparatus -> XmlElementUtil.childText(apparatus, "kind"))
            .orElse("");
        return ExperimentKind.fromApparatus(apparatusKind).orElseThrow(() -> new UnrecognizedExperimentKindException(apparatusKind));
    }
}
