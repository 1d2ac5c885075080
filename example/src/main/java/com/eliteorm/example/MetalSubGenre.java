package com.eliteorm.example;

/** Stored by ordinal: append new constants, never reorder. */
public enum MetalSubGenre {
  DEATH,
  THRASH,
  SPEED,
  HAIR,
  DOOM,
  SLUDGE
}
