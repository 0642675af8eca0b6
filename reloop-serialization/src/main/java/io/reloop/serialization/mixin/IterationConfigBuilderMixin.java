package io.reloop.serialization.mixin;

import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

/// Maps JSON field names directly to `IterationConfig.Builder` methods.
///
/// @see IterationConfigMixin
@JsonPOJOBuilder(withPrefix = "")
public abstract class IterationConfigBuilderMixin {}
