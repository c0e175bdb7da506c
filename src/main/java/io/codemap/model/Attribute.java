package io.codemap.model;

/**
 * Module attribute such as {@code @moduledoc}.
 *
 * @param key   Attribute name without the {@code @}
 * @param value Display text of the attribute value
 */
public record Attribute(String key, String value) {
}
