package io.reloop.serialization.mixin;

import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

/// Maps JSON field names directly to `ValidationResult.Builder` methods.
///
/// @see ValidationResultMixin
@JsonPOJOBuilder(withPrefix = "")
public abstract class ValidationResultBuilderMixin {}
