package it.aw.legalgraph.model;

public record KeyTerm(String term, int frequency) {}
