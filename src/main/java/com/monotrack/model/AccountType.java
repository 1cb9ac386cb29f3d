package com.monotrack.model;

public enum AccountType {
  CARD,
  JAR
}
