package com.shoryokuka.domain.plan.service;

/**
 * Input to a text-generation backend.
 *
 * @param instruction system-level instruction
 * @param input       text to work on
 */
public record GenerationRequest(String instruction, String input) {
}
