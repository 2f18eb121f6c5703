/**
 * Semantic analysis through a chat model: provider contract and discovery
 * ({@link com.pyflow.llm.LlmProvider}, {@link com.pyflow.llm.LlmProviderFactory}),
 * retry decorator, prompts and reply mapping.
 */
package com.pyflow.llm;
