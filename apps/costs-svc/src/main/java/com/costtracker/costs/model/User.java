package com.costtracker.costs.model;

import java.time.LocalDate;

public record User(long id, String firstName, String lastName, LocalDate birthday) {
}
