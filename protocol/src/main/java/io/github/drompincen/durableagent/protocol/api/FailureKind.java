package io.github.drompincen.durableagent.protocol.api;

/**
 * Why a turn failed. Node errors keep the last checkpoint intact, checkpoint errors mean the
 * primary store refused a write, configuration errors come from a router returning an
 * undeclared outcome.
 */
public enum FailureKind {
    NODE_ERROR,
    CHECKPOINT_ERROR,
    CONFIGURATION_ERROR,
    THREAD_BUSY
}
