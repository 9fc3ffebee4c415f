package com.bracketeer.service;

import lombok.Getter;

@Getter
public class BracketValidationException extends RuntimeException {

    private final String code;

    public BracketValidationException(String code, String message) {
        super(message);
        this.code = code;
    }

    public static BracketValidationException teamCountOutOfBounds(int minimum, int maximum) {
        return new BracketValidationException(
                "team_count_out_of_bounds",
                "Number of teams invalid, should be between " + minimum + " and " + maximum
        );
    }

    public static BracketValidationException oddMatchCount(String detail) {
        return new BracketValidationException("odd_match_count", detail);
    }

    public static BracketValidationException roundCountMismatch(String detail) {
        return new BracketValidationException("round_count_mismatch", detail);
    }

    public static BracketValidationException bracketShapeMismatch(String detail) {
        return new BracketValidationException("bracket_shape_mismatch", detail);
    }

    public static BracketValidationException bracketConstructionIncomplete(String detail) {
        return new BracketValidationException("bracket_construction_incomplete", detail);
    }

    public static BracketValidationException matchPositionMismatch(String detail) {
        return new BracketValidationException("match_position_mismatch", detail);
    }

    public static BracketValidationException pairingGeneratorMissing(String detail) {
        return new BracketValidationException("pairing_generator_missing", detail);
    }

    public static BracketValidationException tiedEliminationResult(String detail) {
        return new BracketValidationException("tied_elimination_result", detail);
    }
}
