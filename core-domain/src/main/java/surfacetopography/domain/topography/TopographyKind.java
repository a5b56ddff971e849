package surfacetopography.domain.topography;

import lombok.Getter;

/**
 * Etiqueta del tipo de entidad, usada por el registro para decidir qué operaciones se pueden
 * invocar. Las entidades decoradas heredan la etiqueta de su padre.
 */
@Getter
public enum TopographyKind {
    UNIFORM_LINE_SCAN("line scans uniformes"),
    TOPOGRAPHY("topografías 2D"),
    NONUNIFORM_LINE_SCAN("line scans no uniformes");

    private final String label;

    TopographyKind(String label) {
        this.label = label;
    }
}
