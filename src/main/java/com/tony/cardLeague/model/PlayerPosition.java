package com.tony.cardLeague.model;

public enum PlayerPosition {
    GK, CB, LB, RB, CDM, CM, CAM, LM, RM, LW, RW, ST, CF, LF, RF
}
