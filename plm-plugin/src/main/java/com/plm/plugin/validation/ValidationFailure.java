package com.plm.plugin.validation;

public record ValidationFailure(String plugin, String reason) {
}
