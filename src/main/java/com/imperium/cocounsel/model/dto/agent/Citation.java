package com.imperium.cocounsel.model.dto.agent;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 专家输出中的一条引用。合并时以 reference 文本去重。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Citation {

    /** 来源类别：statute | case | rule | secondary */
    private String source;
    /** 引用文本，如 "K.S.A. 60-513" */
    private String reference;
    /** 可选链接 */
    private String url;
    /** 是否已核实 */
    private boolean verified;
}
