package com.tony.cardLeague.model;

public enum MatchSide { HOME, AWAY }
