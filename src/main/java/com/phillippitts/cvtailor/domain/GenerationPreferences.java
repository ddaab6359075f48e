package com.phillippitts.cvtailor.domain;

/**
 * Which secondary documents a run should produce. Unspecified preferences mean "generate".
 */
public record GenerationPreferences(boolean coverLetter, boolean coldEmail) {

    public static final GenerationPreferences ALL = new GenerationPreferences(true, true);

    public static GenerationPreferences of(Boolean coverLetter, Boolean coldEmail) {
        return new GenerationPreferences(!Boolean.FALSE.equals(coverLetter), !Boolean.FALSE.equals(coldEmail));
    }

    public boolean enabled(DocumentType type) {
        switch (type) {
            case CV:
                return true;
            case COVER_LETTER:
                return coverLetter;
            case COLD_EMAIL:
                return coldEmail;
            default:
                return false;
        }
    }
}
