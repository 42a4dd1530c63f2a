package at.sv.astro.solar;

public enum SunEvent {
    SUNRISE,
    SUNSET
}
