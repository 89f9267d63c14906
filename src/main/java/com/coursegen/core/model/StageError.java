package com.coursegen.core.model;

import java.io.Serializable;

public record StageError(ErrorClass errorClass, String message) implements Serializable {}
