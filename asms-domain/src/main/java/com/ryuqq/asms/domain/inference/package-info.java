/**
 * Inference domain: chat, completion, embedding, speech, image, video, rerank and detection
 * requests delegated to an {@link com.ryuqq.asms.domain.inference.InferenceProvider}.
 *
 * <h2>Units</h2>
 * <ul>
 *   <li>Commands: {@code inference.chat} and {@code inference.complete} (both streaming-capable),
 *       {@code inference.embed}, {@code inference.transcribe}, {@code inference.synthesize},
 *       {@code inference.generate_image}, {@code inference.generate_video}, {@code inference.rerank},
 *       {@code inference.detect}</li>
 *   <li>Queries: {@code inference.models}, {@code inference.voices}</li>
 * </ul>
 *
 * <h2>Streaming</h2>
 * <p>Streaming commands forward provider chunks through
 * {@link com.ryuqq.asms.runtime.stream.StreamBridge} as {@code content} frames whose metadata carries
 * {@code finish_reason}, {@code model} and {@code id} when known.</p>
 *
 * <h2>Resources</h2>
 * <p>{@code asms://inference/models}, polled every 60 seconds; emits {@code models_changed} when the
 * number of models changes.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.asms.domain.inference;
