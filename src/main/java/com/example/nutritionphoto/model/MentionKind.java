package com.example.nutritionphoto.model;

public enum MentionKind {
    NAME,
    VALUE
}
