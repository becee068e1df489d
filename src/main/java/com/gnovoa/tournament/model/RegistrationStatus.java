package com.gnovoa.tournament.model;

public enum RegistrationStatus {
    PENDING,
    PAID,
    CANCELLED
}
