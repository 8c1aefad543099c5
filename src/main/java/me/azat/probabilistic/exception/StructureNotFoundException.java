package me.azat.probabilistic.exception;

public class StructureNotFoundException extends ProbabilisticStructureException {

    private final String name;

    public StructureNotFoundException(String name) {
        super(ErrorCode.STRUCTURE_NOT_FOUND, "Structure '" + name + "' not found");
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
