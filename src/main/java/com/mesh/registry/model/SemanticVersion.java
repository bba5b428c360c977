package com.mesh.registry.model;

import com.mesh.registry.exception.InvalidVersionFormatException;
import lombok.Value;

import java.util.Comparator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * MAJOR.MINOR.PATCH, ordered by comparing the three integers in turn.
 */
@Value
public class SemanticVersion implements Comparable<SemanticVersion> {

    public static final SemanticVersion INITIAL = new SemanticVersion(1, 0, 0);

    private static final Pattern FORMAT = Pattern.compile("(\\d+)\\.(\\d+)\\.(\\d+)");

    private static final Comparator<SemanticVersion> ORDER = Comparator
            .comparingInt(SemanticVersion::getMajor)
            .thenComparingInt(SemanticVersion::getMinor)
            .thenComparingInt(SemanticVersion::getPatch);

    int major;
    int minor;
    int patch;

    public SemanticVersion(int major, int minor, int patch) {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException("version components must be >= 0");
        }
        this.major = major;
        this.minor = minor;
        this.patch = patch;
    }

    public static SemanticVersion parse(String value) {
        if (value == null) {
            throw new InvalidVersionFormatException("Version must not be null");
        }
        Matcher m = FORMAT.matcher(value.trim());
        if (!m.matches()) {
            throw new InvalidVersionFormatException("Invalid version format: '" + value + "' (expected MAJOR.MINOR.PATCH)");
        }
        try {
            return new SemanticVersion(
                    Integer.parseInt(m.group(1)),
                    Integer.parseInt(m.group(2)),
                    Integer.parseInt(m.group(3)));
        } catch (NumberFormatException e) {
            throw new InvalidVersionFormatException("Version component out of range: '" + value + "'", e);
        }
    }

    public SemanticVersion bump(BumpKind kind) {
        return switch (kind) {
            case MAJOR -> new SemanticVersion(major + 1, 0, 0);
            case MINOR -> new SemanticVersion(major, minor + 1, 0);
            case PATCH -> new SemanticVersion(major, minor, patch + 1);
        };
    }

    @Override
    public int compareTo(SemanticVersion other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch;
    }
}
