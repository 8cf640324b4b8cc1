/**
 * Text similarity: preprocessing, the pluggable
 * {@link com.driftguard.core.semantic.TextEmbedder}, vector and lexical
 * similarity methods, and the {@link com.driftguard.core.semantic.SemanticComparator}.
 */
package com.driftguard.core.semantic;
