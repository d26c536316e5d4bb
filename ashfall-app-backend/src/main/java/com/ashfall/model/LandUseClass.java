package com.ashfall.model;

import javax.persistence.*;

/**
 * Entry of the land-use legend (MapBiomas Indonesia codes).
 */
@Entity
@Table(name = "land_use_classes")
public class LandUseClass {

    @Id
    @Column(nullable = false)
    private Integer code;

    @Column(nullable = false)
    private String name;

    // hex colour used by map renderers
    @Column(length = 16)
    private String color;

    public LandUseClass() {
    }

    public LandUseClass(Integer code, String name, String color) {
        this.code = code;
        this.name = name;
        this.color = color;
    }

    public Integer getCode() {
        return code;
    }

    public void setCode(Integer code) {
        this.code = code;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getColor() {
        return color;
    }

    public void setColor(String color) {
        this.color = color;
    }
}
