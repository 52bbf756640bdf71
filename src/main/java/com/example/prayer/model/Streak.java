package com.example.prayer.model;

import lombok.Value;

@Value
public class Streak {

    public static final Streak ZERO = new Streak(0, 0);

    int current;
    int longest;
}
