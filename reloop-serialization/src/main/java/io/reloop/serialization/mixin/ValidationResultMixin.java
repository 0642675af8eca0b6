package io.reloop.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.reloop.core.validation.ValidationResult;

/// Jackson mixin that binds `ValidationResult` deserialization to its builder.
///
/// `error` is omitted from the JSON when the rule evaluated cleanly.
///
/// @see ValidationResultBuilderMixin
@JsonDeserialize(builder = ValidationResult.Builder.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class ValidationResultMixin {}
