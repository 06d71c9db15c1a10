package com.todoservice.db;

/**
 * The mutable fields of a todo. Applying an update never touches the identifier or the creation
 * time.
 *
 * @param title The new title
 * @param completed The new completion flag
 */
public record TodoUpdate(String title, boolean completed) {}
