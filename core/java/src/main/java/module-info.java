module io.github.cyfko.metricql.core {
    requires java.logging;
    requires com.fasterxml.jackson.databind;

    exports io.github.cyfko.metricql.core;
    exports io.github.cyfko.metricql.core.alias;
    exports io.github.cyfko.metricql.core.api;
    exports io.github.cyfko.metricql.core.compiler;
    exports io.github.cyfko.metricql.core.config;
    exports io.github.cyfko.metricql.core.entity;
    exports io.github.cyfko.metricql.core.exception;
    exports io.github.cyfko.metricql.core.impl;
    exports io.github.cyfko.metricql.core.model;
    exports io.github.cyfko.metricql.core.parsing;
}
