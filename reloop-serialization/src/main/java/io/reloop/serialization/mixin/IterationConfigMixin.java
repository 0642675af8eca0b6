package io.reloop.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.reloop.core.iteration.IterationConfig;

/// Jackson mixin that binds `IterationConfig` deserialization to its builder.
///
/// Absent optional fields fall back to the builder defaults, so stored configs written
/// before a field existed still load with today's default.
///
/// @see IterationConfigBuilderMixin
@JsonDeserialize(builder = IterationConfig.Builder.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class IterationConfigMixin {}
