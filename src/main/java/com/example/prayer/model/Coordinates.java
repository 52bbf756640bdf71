package com.example.prayer.model;

import lombok.Value;

@Value
public class Coordinates {
    double latitude;
    double longitude;
}
