package org.collabstore.configuration;

import java.util.Objects;

import net.jcip.annotations.Immutable;

/**
 * A configuration key together with a label and the value used when a {@link RuntimeProperties} lacks the key.
 * Declared as constants by the class that reads them, e.g. {@code TextField.CHECK_INVARIANTS}.
 *
 * @since 1.0
 */
@Immutable
public final class Property {
    private final String name, label, description;
    private final Object default_value;

    private Property(Builder b) {
        this.name=b.name;
        this.label=b.label != null? b.label : b.name;
        this.description=b.description != null? b.description : "";
        this.default_value=b.default_value;
    }

    public static Builder create(String name) {
        return new Builder(name);
    }

    public String name()         {return name;}
    public String label()        {return label;}
    public String description()  {return description;}
    /** May be null */
    public Object defaultValue() {return default_value;}

    public String defaultValueAsString() {
        return default_value != null? default_value.toString() : null;
    }

    @Override
    public String toString() {
        return String.format("%s (default=%s)", name, defaultValueAsString());
    }

    public static final class Builder {
        private final String name;
        private String       label, description;
        private Object       default_value;

        private Builder(String name) {
            this.name=Objects.requireNonNull(name, "name");
        }

        public Builder label(String l)        {this.label=l; return this;}
        public Builder description(String d)  {this.description=d; return this;}
        public Builder defaultValue(Object v) {this.default_value=v; return this;}

        public Property build() {
            return new Property(this);
        }
    }
}
