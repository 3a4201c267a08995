/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Astrolabe.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.astrolabe.wcs.backend;

import com.hellblazer.astrolabe.wcs.classify.ClassificationPolicy;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Properties;

/**
 * Configuration for backend selection and engine construction.
 * Built with explicit parameters; {@link #fromProperties(Properties)} maps a host application's property file onto
 * the builder.
 *
 * @author hal.hildebrand
 */
public class WcsConfiguration {

    public static final String PREFERENCE_PROPERTY     = "astrolabe.wcs.preference";
    public static final String BACKEND_PROPERTY        = "astrolabe.wcs.backend";
    public static final String STRICT_PROPERTY         = "astrolabe.wcs.strict";
    public static final String CLASSIFICATION_PROPERTY = "astrolabe.wcs.classification";

    public static final List<WcsBackend> DEFAULT_PREFERENCE = List.of(WcsBackend.WCSLIB, WcsBackend.AST,
                                                                      WcsBackend.WCSTOOLS);

    private final List<WcsBackend>     preferenceOrder;
    private final WcsBackend           forcedBackend;
    private final SelectionMode        selectionMode;
    private final ClassificationPolicy classificationPolicy;

    private WcsConfiguration(Builder builder) {
        this.preferenceOrder = List.copyOf(builder.preferenceOrder);
        this.forcedBackend = builder.forcedBackend;
        this.selectionMode = builder.selectionMode;
        this.classificationPolicy = builder.classificationPolicy;
    }

    /**
     * Get the default configuration.
     * - Preference: wcslib, ast, wcstools
     * - No forced backend
     * - Each backend's own classification policy
     */
    public static WcsConfiguration getDefault() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Read a configuration from properties. Unknown backend or policy names are rejected.
     *
     * @throws IllegalArgumentException on an unknown backend or policy name
     */
    public static WcsConfiguration fromProperties(Properties properties) {
        var builder = new Builder();
        var preference = properties.getProperty(PREFERENCE_PROPERTY);
        if (preference != null && !preference.isBlank()) {
            var order = new ArrayList<WcsBackend>();
            for (var name : preference.split(",")) {
                if (!name.isBlank()) {
                    order.add(backendNamed(name));
                }
            }
            builder.withPreferenceOrder(order);
        }
        var backend = properties.getProperty(BACKEND_PROPERTY);
        if (backend != null && !backend.isBlank()) {
            builder.withForcedBackend(backendNamed(backend));
        }
        builder.withSelectionMode(Boolean.parseBoolean(properties.getProperty(STRICT_PROPERTY, "false")) ?
                                  SelectionMode.STRICT : SelectionMode.LENIENT);
        var policy = properties.getProperty(CLASSIFICATION_PROPERTY);
        if (policy != null && !policy.isBlank()) {
            builder.withClassificationPolicy(ClassificationPolicy.valueOf(policy.trim().toUpperCase(Locale.ROOT)));
        }
        return builder.build();
    }

    private static WcsBackend backendNamed(String name) {
        return WcsBackend.fromName(name)
                         .orElseThrow(() -> new IllegalArgumentException("Unknown WCS backend: '" + name.trim() + "'"));
    }

    public List<WcsBackend> getPreferenceOrder() {
        return preferenceOrder;
    }

    public Optional<WcsBackend> getForcedBackend() {
        return Optional.ofNullable(forcedBackend);
    }

    public SelectionMode getSelectionMode() {
        return selectionMode;
    }

    /**
     * Policy applied to every engine; empty means each backend uses its own default.
     */
    public Optional<ClassificationPolicy> getClassificationPolicy() {
        return Optional.ofNullable(classificationPolicy);
    }

    @Override
    public String toString() {
        return "WcsConfiguration{" + "preferenceOrder=" + preferenceOrder + ", forcedBackend=" + forcedBackend
        + ", selectionMode=" + selectionMode + ", classificationPolicy=" + classificationPolicy + '}';
    }

    /**
     * Builder for WcsConfiguration.
     */
    public static class Builder {
        private List<WcsBackend>     preferenceOrder      = DEFAULT_PREFERENCE;
        private WcsBackend           forcedBackend        = null;
        private SelectionMode        selectionMode        = SelectionMode.LENIENT;
        private ClassificationPolicy classificationPolicy = null;

        public Builder withPreferenceOrder(List<WcsBackend> order) {
            this.preferenceOrder = List.copyOf(order);
            return this;
        }

        public Builder withForcedBackend(WcsBackend backend) {
            this.forcedBackend = backend;
            return this;
        }

        public Builder withSelectionMode(SelectionMode mode) {
            this.selectionMode = mode;
            return this;
        }

        public Builder withClassificationPolicy(ClassificationPolicy policy) {
            this.classificationPolicy = policy;
            return this;
        }

        public WcsConfiguration build() {
            return new WcsConfiguration(this);
        }
    }
}
