package colorbatch.utils;

import picocli.CommandLine.*;

import java.io.*;
import java.util.*;

/**
 * Reports the tool version for {@code --version}.
 * The jar manifest wins; when running from classes (tests, IDE) the filtered
 * {@code version.properties} resource is used instead.
 */
public class VersionProvider implements IVersionProvider {
    static final String VERSION_RESOURCE_PATH = "/version.properties";

    @Override
    public String[] getVersion() throws Exception {
        Package pkg = VersionProvider.class.getPackage();
        String title = pkg != null ? pkg.getImplementationTitle() : null;
        String version = pkg != null ? pkg.getImplementationVersion() : null;

        if (version == null) {
            Properties props = loadVersionProperties();
            title = props.getProperty("title");
            version = props.getProperty("version");
        }

        return new String[] {
                String.format("%s version %s",
                        StringUtils.getOrDefault(title, "colorbatch"),
                        StringUtils.getOrDefault(version, "unknown-version")),
                String.format("Java %s (%s)", System.getProperty("java.version"), System.getProperty("java.vendor")),
        };
    }

    private static Properties loadVersionProperties() throws IOException {
        Properties props = new Properties();
        try (InputStream in = VersionProvider.class.getResourceAsStream(VERSION_RESOURCE_PATH)) {
            if (in != null) {
                props.load(in);
            }
        }
        return props;
    }
}
