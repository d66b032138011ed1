package org.csu.algolisp.compiler.parser.ast.definition;

import org.csu.algolisp.compiler.parser.ast.DefinitionNode;

import java.util.List;

/**
 * AST 节点: record 定义
 *
 * @param typeName          记录类型名
 * @param constructor       构造函数名
 * @param constructorFields 构造函数参数 (字段名)
 * @param predicate         类型判断函数名
 * @param fields            字段规格列表
 */
public record RecordDefinitionNode(
        String typeName,
        String constructor,
        List<String> constructorFields,
        String predicate,
        List<FieldSpecNode> fields
) implements DefinitionNode {

    public RecordDefinitionNode {
        constructorFields = List.copyOf(constructorFields);
        fields = List.copyOf(fields);
    }
}
