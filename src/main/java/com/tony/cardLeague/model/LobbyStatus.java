package com.tony.cardLeague.model;

public enum LobbyStatus { WAITING, IN_PROGRESS, FINISHED }
