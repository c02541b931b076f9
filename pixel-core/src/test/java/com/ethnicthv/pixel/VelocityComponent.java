package com.ethnicthv.pixel;

import com.ethnicthv.pixel.core.components.Component;

public class VelocityComponent implements Component {
    public float vx;
    public float vy;

    public VelocityComponent(float vx, float vy) {
        this.vx = vx;
        this.vy = vy;
    }
}
