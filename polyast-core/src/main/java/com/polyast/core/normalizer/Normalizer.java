package com.polyast.core.normalizer;

import com.polyast.core.ast.Any;
import com.polyast.core.ast.Stmt;
import com.polyast.core.lang.Language;

import java.util.List;

/**
 * Translates one language's syntax tree into the generic AST.
 *
 * <p>A normalizer is created per source file by its {@link NormalizerProvider} and is
 * not shared between threads. Translation is a pure function of the input tree: source
 * positions are taken from the collaborator's tokens and fake tokens appear only where
 * structure has to be synthesized. Constructs without a generic counterpart become the
 * {@code Other*} variant of their category; they never fail.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Normalizer<?> normalizer = Normalizers.forLanguage(Language.JAVA, sourceFile);
 * List<Stmt> program = Normalizers.normalize(Language.JAVA, compilationUnit, sourceFile);
 * }</pre>
 *
 * @param <T> root type of the collaborator tree
 * @see Normalizers
 * @since 1.0.0
 */
public interface Normalizer<T> {

    /**
     * Returns the language this normalizer translates.
     *
     * @return source language
     */
    Language language();

    /**
     * Returns the collaborator's root type, used to reject trees of the wrong language.
     *
     * @return root node class
     */
    Class<T> astType();

    /**
     * Translates a whole file.
     *
     * @param root collaborator root node
     * @return top-level statements in source order
     * @throws NormalizationException if the tree violates a guarantee of its grammar
     */
    List<Stmt> program(T root);

    /**
     * Translates an arbitrary fragment: a program root, a statement, an expression or
     * any other node the collaborator exposes.
     *
     * @param fragment collaborator node
     * @return the fragment in the generic AST
     * @throws IllegalArgumentException if the fragment is not a node of this language
     * @throws NormalizationException if the tree violates a guarantee of its grammar
     */
    Any any(Object fragment);
}
