package edu.harvard.hms.dbmi.avillach.kinetics.etl.experiment;

import org.springframework.core.io.ClassPathResource;
import org.w3c.dom.Element;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

final class ExperimentFixtures {

    static final String SHOCK_TUBE = "testfile_st.xml";
    static final String SHOCK_TUBE_PRESSURE_RISE = "testfile_st2.xml";
    static final String RCM = "testfile_rcm.xml";
    static final String INCONSISTENT_RCM = "testfile_inconsistent_rcm.xml";

    private static final ExperimentReader reader = new ExperimentReader();

    private ExperimentFixtures() {
    }

    static Element root(String fixture) {
        try (InputStream in = new ClassPathResource("experiments/" + fixture).getInputStream()) {
            return reader.parse(in);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static Path path(String fixture) {
        try {
            return new ClassPathResource("experiments/" + fixture).getFile().toPath();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static Element rootOf(String xml) {
        return reader.parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
    }
}
