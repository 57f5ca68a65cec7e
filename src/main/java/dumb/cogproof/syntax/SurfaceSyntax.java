package dumb.cogproof.syntax;

import dumb.cogproof.Formula;
import dumb.cogproof.TranslationException;
import dumb.cogproof.ValidationException;

import java.util.List;

/** Parser and serializer pair for one surface syntax. */
public interface SurfaceSyntax {

    Syntax syntax();

    Formula parse(String text) throws ValidationException;

    String serialize(Formula f) throws TranslationException;

    /** What serializing {@code f} loses; empty when the round trip is exact. */
    default List<String> losses(Formula f) {
        return List.of();
    }

    default boolean lossless(Formula f) {
        return losses(f).isEmpty();
    }
}
