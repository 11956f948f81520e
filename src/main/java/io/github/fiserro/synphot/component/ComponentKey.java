package io.github.fiserro.synphot.component;

/**
 * Identity of a built component.
 *
 * @param fileName throughput file reference, including any parameter marker
 * @param parameter interpolation value, {@code null} for unparameterized components
 */
public record ComponentKey(String fileName, Double parameter) {}
