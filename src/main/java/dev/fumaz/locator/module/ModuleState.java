package dev.fumaz.locator.module;

public enum ModuleState {

    UNBUILT,
    BUILDING,
    BUILT

}
