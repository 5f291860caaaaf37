package me.golemcore.agent.domain.model;

/**
 * One entry of a plan.
 */
public record TodoItem(String content, TodoStatus status) {
}
