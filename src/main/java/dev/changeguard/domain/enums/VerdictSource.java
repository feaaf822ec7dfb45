package dev.changeguard.domain.enums;

/** Which synthesis strategy produced a verdict. */
public enum VerdictSource {
    MODEL, RULES
}
