package im.arun.taxonomy.model;

import lombok.Value;

/**
 * One open level of the ancestor chain: depth, concept identifier, label.
 */
@Value
public class AncestorFrame {
    int depth;
    String conceptName;
    String label;
}
